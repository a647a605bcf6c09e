package ru.stepanov.convolve.engine;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static ru.stepanov.convolve.engine.PixelMath.clampToRange;

public class PixelMathTest {

    @Test
    public void testClampToRange() {
        assertEquals(0, clampToRange(-5, 0, 255));
        assertEquals(255, clampToRange(2040, 0, 255));
        assertEquals(17, clampToRange(17, 0, 255));
        assertEquals(0, clampToRange(-1, 0, 0));
        assertEquals(4, clampToRange(5, 0, 4));
    }
}
