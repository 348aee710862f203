/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Chaos Engine.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.chaos.render.settings;

import com.hellblazer.chaos.fractal.core.FractalFamily;

import java.util.Locale;
import java.util.Optional;

/**
 * Parses the explicit Julia constant fields. A constant that parses replaces the one derived from the intent.
 */
public final class JuliaConstantInput {

    private JuliaConstantInput() {
    }

    /**
     * @return the constant, or empty unless both parts are finite numbers
     */
    public static Optional<FractalFamily.Julia> parse(String realText, String imagText) {
        if (realText == null || imagText == null) {
            return Optional.empty();
        }
        try {
            double cReal = Double.parseDouble(realText.trim());
            double cImag = Double.parseDouble(imagText.trim());
            if (!Double.isFinite(cReal) || !Double.isFinite(cImag)) {
                return Optional.empty();
            }
            return Optional.of(new FractalFamily.Julia(cReal, cImag));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Field text for a constant, four decimals.
     */
    public static String[] format(FractalFamily.Julia julia) {
        return new String[] { String.format(Locale.ROOT, "%.4f", julia.cReal()),
                              String.format(Locale.ROOT, "%.4f", julia.cImag()) };
    }
}
