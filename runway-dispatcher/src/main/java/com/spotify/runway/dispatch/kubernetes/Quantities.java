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

package com.spotify.runway.dispatch.kubernetes;

import com.google.common.collect.ImmutableList;
import io.fabric8.kubernetes.api.model.Quantity;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;

/**
 * Renders quantities in the canonical form the Kubernetes API server reports them in, e.g.
 * {@code 2048Mi} as {@code 2Gi} and {@code 1000M} as {@code 1G}.
 */
final class Quantities {

  private static final List<String> BINARY_SUFFIXES = ImmutableList.of("", "Ki", "Mi", "Gi", "Ti", "Pi", "Ei");
  private static final BigInteger KIBI = BigInteger.valueOf(1024);

  // Indexed by (exponent / 3) + 3, for exponents -9..18
  private static final List<String> DECIMAL_SUFFIXES =
      ImmutableList.of("n", "u", "m", "", "k", "M", "G", "T", "P", "E");
  private static final int MIN_DECIMAL_EXPONENT = -9;
  private static final int MAX_DECIMAL_EXPONENT = 18;

  private Quantities() {
    throw new UnsupportedOperationException();
  }

  static String canonical(Quantity quantity) {
    final BigDecimal value = Quantity.getAmountInBytes(quantity);
    if (value.signum() == 0) {
      return "0";
    }

    final String format = quantity.getFormat() == null ? "" : quantity.getFormat();
    if (BINARY_SUFFIXES.contains(format) && !format.isEmpty()
        && value.abs().compareTo(BigDecimal.valueOf(1024)) >= 0 && isInteger(value)) {
      return binary(value.toBigIntegerExact());
    }
    return decimal(value, format.startsWith("e") || format.startsWith("E"));
  }

  private static String binary(BigInteger value) {
    BigInteger amount = value;
    int power = 0;
    while (power < BINARY_SUFFIXES.size() - 1 && amount.mod(KIBI).signum() == 0) {
      amount = amount.divide(KIBI);
      power++;
    }
    return amount + BINARY_SUFFIXES.get(power);
  }

  private static String decimal(BigDecimal value, boolean exponentForm) {
    // Anything finer than nano precision is rounded up
    final BigDecimal rounded = value.setScale(-MIN_DECIMAL_EXPONENT, RoundingMode.CEILING);
    for (int exponent = MAX_DECIMAL_EXPONENT; exponent > MIN_DECIMAL_EXPONENT; exponent -= 3) {
      final BigDecimal amount = rounded.movePointLeft(exponent);
      if (isInteger(amount)) {
        return render(amount, exponent, exponentForm);
      }
    }
    return render(rounded.movePointRight(-MIN_DECIMAL_EXPONENT), MIN_DECIMAL_EXPONENT, exponentForm);
  }

  private static String render(BigDecimal amount, int exponent, boolean exponentForm) {
    final String digits = amount.toBigIntegerExact().toString();
    if (exponentForm) {
      return exponent == 0 ? digits : digits + "e" + exponent;
    }
    return digits + DECIMAL_SUFFIXES.get(exponent / 3 + 3);
  }

  private static boolean isInteger(BigDecimal value) {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }
}
