/*
 * Copyright 2026 The Closure Compiler Authors.
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
 */

package com.google.mason.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** Describes how an editor re-parses a span after an incremental edit. */
public final class EditHandler {

  /** Characters a span accepts before an edit forces a full re-parse. */
  public enum AcceptedCharacters {
    NONE("None"),
    NEW_LINE("NewLine"),
    WHITESPACE("WhiteSpace"),
    NON_WHITESPACE("NonWhiteSpace"),
    ALL_WHITESPACE("AllWhiteSpace"),
    ANY_EXCEPT_NEW_LINE("AnyExceptNewline"),
    ANY("Any");

    private final String displayName;

    AcceptedCharacters(String displayName) {
      this.displayName = displayName;
    }

    @Override
    public String toString() {
      return displayName;
    }
  }

  private final AcceptedCharacters acceptedCharacters;
  private final @Nullable String autoCompleteString;

  private EditHandler(AcceptedCharacters acceptedCharacters, @Nullable String autoCompleteString) {
    this.acceptedCharacters = checkNotNull(acceptedCharacters);
    this.autoCompleteString = autoCompleteString;
  }

  public static EditHandler accepting(AcceptedCharacters acceptedCharacters) {
    return new EditHandler(acceptedCharacters, null);
  }

  /** A handler that completes an unterminated block with {@code autoCompleteString}. */
  public static EditHandler autoComplete(
      AcceptedCharacters acceptedCharacters, String autoCompleteString) {
    return new EditHandler(acceptedCharacters, checkNotNull(autoCompleteString));
  }

  public AcceptedCharacters getAcceptedCharacters() {
    return acceptedCharacters;
  }

  public @Nullable String getAutoCompleteString() {
    return autoCompleteString;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof EditHandler)) {
      return false;
    }
    EditHandler that = (EditHandler) o;
    return acceptedCharacters == that.acceptedCharacters
        && Objects.equals(autoCompleteString, that.autoCompleteString);
  }

  @Override
  public int hashCode() {
    return Objects.hash(acceptedCharacters, autoCompleteString);
  }

  @Override
  public String toString() {
    if (autoCompleteString == null) {
      return "SpanEditHandler;Accepts:" + acceptedCharacters;
    }
    return "AutoCompleteEditHandler;Accepts:"
        + acceptedCharacters
        + ",AutoComplete:["
        + autoCompleteString
        + "]";
  }
}
