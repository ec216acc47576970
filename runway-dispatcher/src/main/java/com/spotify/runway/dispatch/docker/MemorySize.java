/*-
 * -\-\-
 * Spotify Runway Dispatcher
 * --
 * Copyright (C) 2023 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.runway.dispatch.docker;

import com.spotify.runway.model.InvalidPluginDataException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human readable memory sizes the way the docker CLI does, e.g. {@code 512m}, {@code 2g} or
 * {@code 1GiB}. Units are binary multiples; a bare number is a byte count.
 */
final class MemorySize {

  private static final Pattern SIZE =
      Pattern.compile("^(\\d+(?:\\.\\d+)?) ?([kmgtp])?i?b?$", Pattern.CASE_INSENSITIVE);

  private MemorySize() {
    throw new UnsupportedOperationException();
  }

  static long parseBytes(String value) {
    final Matcher matcher = SIZE.matcher(value.trim());
    if (!matcher.matches()) {
      throw new InvalidPluginDataException("invalid memory size '" + value + "'");
    }

    final double amount = Double.parseDouble(matcher.group(1));
    final String unit = matcher.group(2);
    final int exponent = unit == null ? 0 : "kmgtp".indexOf(unit.toLowerCase(Locale.ROOT)) + 1;
    final double bytes = amount * Math.pow(1024, exponent);
    if (bytes >= Long.MAX_VALUE) {
      throw new InvalidPluginDataException("memory size '" + value + "' is too large");
    }
    return (long) bytes;
  }
}
