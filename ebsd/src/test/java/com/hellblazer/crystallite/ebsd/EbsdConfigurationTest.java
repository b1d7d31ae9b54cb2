/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Crystallite.
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
package com.hellblazer.crystallite.ebsd;

import com.hellblazer.crystallite.ebsd.orientation.SymmetryClass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EbsdConfiguration.
 *
 * @author hal.hildebrand
 */
public class EbsdConfigurationTest {

    @Test
    public void testDefaultConfiguration() {
        var config = EbsdConfiguration.defaultConfig();

        assertEquals(EbsdConfiguration.DEFAULT_BOUNDARY_ANGLE, config.boundaryAngle());
        assertEquals(EbsdConfiguration.DEFAULT_MIN_GRAIN_SIZE, config.minGrainSize());
        assertEquals(EbsdConfiguration.DEFAULT_PROXIGRAM_TRIALS, config.proxigramTrials());
        assertSame(SymmetryClass.CUBIC, config.symmetry());
        assertTrue(config.isParallel());
    }

    @Test
    public void testInvalidBoundaryAngleThrows() {
        var cubic = SymmetryClass.CUBIC;
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(0, 10, cubic, 500, true));
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(-5, 10, cubic, 500, true));
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(180.5, 10, cubic, 500, true));
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(Double.NaN, 10, cubic, 500, true));
        assertDoesNotThrow(() -> new EbsdConfiguration(180, 10, cubic, 500, true));
    }

    @Test
    public void testInvalidSizesThrow() {
        var cubic = SymmetryClass.CUBIC;
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(10, 0, cubic, 500, true));
        assertThrows(IllegalArgumentException.class, () -> new EbsdConfiguration(10, 10, cubic, 0, true));
        assertThrows(NullPointerException.class, () -> new EbsdConfiguration(10, 10, null, 500, true));
    }

    @Test
    public void testWithMethods() {
        var original = EbsdConfiguration.defaultConfig();
        var hexagonal = SymmetryClass.hexagonal(1.587);

        var modified = original.withBoundaryAngle(5)
                               .withMinGrainSize(3)
                               .withSymmetry(hexagonal)
                               .withProxigramTrials(50)
                               .withParallel(false);

        assertEquals(5, modified.boundaryAngle());
        assertEquals(3, modified.minGrainSize());
        assertEquals(hexagonal, modified.symmetry());
        assertEquals(50, modified.proxigramTrials());
        assertFalse(modified.isParallel());

        assertEquals(EbsdConfiguration.defaultConfig(), original, "with methods must not modify the original");
        assertThrows(IllegalArgumentException.class, () -> original.withMinGrainSize(0));
    }

    @Test
    public void testEqualsAndHashCode() {
        var a = EbsdConfiguration.defaultConfig().withBoundaryAngle(15);
        var b = EbsdConfiguration.defaultConfig().withBoundaryAngle(15);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, b.withParallel(false));
        assertTrue(a.toString().contains("15"));
    }
}
