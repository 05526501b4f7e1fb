package me.golemcore.responder.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;

/**
 * Word-boundary aware substring matching shared by keyword scoring and the
 * signal lexicons.
 *
 * <p>
 * A term matches when it occurs in the text and, on each side where the term
 * starts or ends with a letter or digit, the neighbouring character is not a
 * letter or digit. So {@code "hi"} does not match {@code "this"}, while
 * {@code "/help"} and emoji terms match wherever they appear.
 */
final class TextMatching {

    private TextMatching() {
    }

    static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    /**
     * @param normalizedText
     *            text already lower-cased with {@link #normalize(String)}
     * @param normalizedTerm
     *            term already lower-cased
     */
    static boolean containsTerm(String normalizedText, String normalizedTerm) {
        if (normalizedTerm == null || normalizedTerm.isEmpty()) {
            return false;
        }
        boolean checkStart = Character.isLetterOrDigit(normalizedTerm.codePointAt(0));
        boolean checkEnd = Character.isLetterOrDigit(normalizedTerm.codePointBefore(normalizedTerm.length()));

        int from = 0;
        while (true) {
            int index = normalizedText.indexOf(normalizedTerm, from);
            if (index < 0) {
                return false;
            }
            int end = index + normalizedTerm.length();
            boolean startOk = !checkStart || index == 0
                    || !Character.isLetterOrDigit(normalizedText.codePointBefore(index));
            boolean endOk = !checkEnd || end == normalizedText.length()
                    || !Character.isLetterOrDigit(normalizedText.codePointAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = index + 1;
        }
    }
}
