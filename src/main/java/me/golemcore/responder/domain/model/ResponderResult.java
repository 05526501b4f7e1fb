package me.golemcore.responder.domain.model;

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

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed success-or-failure wrapper returned by every public operation of the
 * core. Failures carry a {@link ResponderFailureKind} and a message instead of
 * an exception, so nothing is thrown across the response path.
 *
 * @param <T>
 *            type of the success value
 * @since 1.0
 */
public final class ResponderResult<T> {

    private final T value;
    private final ResponderFailureKind failureKind;
    private final String error;

    private ResponderResult(T value, ResponderFailureKind failureKind, String error) {
        this.value = value;
        this.failureKind = failureKind;
        this.error = error;
    }

    public static <T> ResponderResult<T> success(T value) {
        return new ResponderResult<>(value, null, null);
    }

    public static <T> ResponderResult<T> failure(ResponderFailureKind kind, String error) {
        return new ResponderResult<>(null, Objects.requireNonNull(kind, "kind"), error);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    public T getValue() {
        return value;
    }

    public ResponderFailureKind getFailureKind() {
        return failureKind;
    }

    public String getError() {
        return error;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public <R> ResponderResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(failureKind, error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ResponderResult{success, value=" + value + "}"
                : "ResponderResult{failure=" + failureKind + ", error=" + error + "}";
    }
}
