package ru.stepanov.convolve.engine;

import org.junit.Test;
import ru.stepanov.convolve.image.PixelBuffer;
import ru.stepanov.convolve.kernel.Kernel;
import ru.stepanov.convolve.kernel.KernelCatalog;

import static org.junit.Assert.*;

public class ConvolutionEngineTest {

    private final KernelCatalog catalog = KernelCatalog.standard();

    @Test
    public void testIdentityReproducesInput() {
        PixelBuffer input = ConvolutionTestImages.random(7, 5, 42);
        for (int threads : new int[]{1, 3, 4, 35}) {
            PixelBuffer output = PixelBuffer.allocate(7, 5);
            ConvolutionEngine.convolve(input, output, catalog.defaultKernel(), threads);
            assertTrue("потоков: " + threads, output.sameContent(input));
        }
    }

    @Test
    public void testOneAndFourWorkersProduceIdenticalOutput() {
        PixelBuffer input = ConvolutionTestImages.random(8, 8, 7);
        for (Kernel kernel : catalog.kernels()) {
            PixelBuffer sequential = PixelBuffer.allocate(8, 8);
            PixelBuffer parallel = PixelBuffer.allocate(8, 8);

            ConvolutionEngine.convolve(input, sequential, kernel, 1);
            ConvolutionEngine.convolve(input, parallel, kernel, 4);

            assertTrue(kernel.getName(), parallel.sameContent(sequential));
        }
    }

    @Test
    public void testUnevenWorkerCountsCoverWholeImage() {
        PixelBuffer input = ConvolutionTestImages.random(9, 7, 123);
        Kernel gaussian = catalog.lookup("gaussian-blur").get();
        PixelBuffer expected = ConvolutionTestImages.reference(input, gaussian);

        for (int threads : new int[]{2, 3, 5, 6, 10, 13, 100}) {
            PixelBuffer output = PixelBuffer.allocate(9, 7);
            ConvolutionEngine.convolve(input, output, gaussian, threads);
            assertTrue("потоков: " + threads, output.sameContent(expected));
        }
    }

    @Test
    public void testMatchesReferenceForEveryCatalogKernel() {
        PixelBuffer input = ConvolutionTestImages.random(6, 11, 2024);
        for (Kernel kernel : catalog.kernels()) {
            PixelBuffer output = PixelBuffer.allocate(6, 11);
            ConvolutionEngine.convolve(input, output, kernel, 3);
            assertTrue(kernel.getName(), output.sameContent(ConvolutionTestImages.reference(input, kernel)));
        }
    }

    @Test
    public void testSharpenLeavesWhiteImageWhite() {
        PixelBuffer white = ConvolutionTestImages.filled(3, 3, 255, 255, 255, 255);
        PixelBuffer output = PixelBuffer.allocate(3, 3);

        ConvolutionEngine.convolve(white, output, catalog.lookup("sharpen").get(), 1);

        assertTrue(output.sameContent(white));
    }

    @Test
    public void testSinglePixelImageUsesEdgeReplication() {
        PixelBuffer pixel = ConvolutionTestImages.filled(1, 1, 100, 50, 20, 77);
        for (Kernel kernel : catalog.kernels()) {
            PixelBuffer output = PixelBuffer.allocate(1, 1);
            ConvolutionEngine.convolve(pixel, output, kernel, 1);

            int weightSum = 0;
            for (int[] row : kernel.getWeights()) {
                for (int weight : row) {
                    weightSum += weight;
                }
            }
            int[] source = {100, 50, 20};
            for (int b = 0; b < 3; b++) {
                int expected = PixelMath.clampToRange(weightSum * source[b] / kernel.getNormalization(), 0, 255);
                assertEquals(kernel.getName(), expected, output.get(0, 0, b));
            }
            assertEquals(77, output.get(0, 0, PixelBuffer.ALPHA));
        }
    }

    @Test
    public void testChannelsAreClampedAndAlphaIsKept() {
        PixelBuffer input = ConvolutionTestImages.filled(3, 3, 0, 0, 0, 13);
        input.set(1, 1, PixelBuffer.RED, 255);
        input.set(1, 1, PixelBuffer.ALPHA, 200);
        PixelBuffer output = PixelBuffer.allocate(3, 3);

        ConvolutionEngine.convolve(input, output, catalog.lookup("edge-detect").get(), 2);

        // 8 * 255 -> 255, соседи получают -255 -> 0
        assertEquals(255, output.get(1, 1, PixelBuffer.RED));
        assertEquals(0, output.get(0, 0, PixelBuffer.RED));
        assertEquals(0, output.get(2, 1, PixelBuffer.RED));
        assertEquals(200, output.get(1, 1, PixelBuffer.ALPHA));
        assertEquals(13, output.get(0, 2, PixelBuffer.ALPHA));
    }

    @Test
    public void testLargeWeightsSaturate() {
        Kernel boost = new Kernel("boost", new int[][]{{0, 0, 0}, {0, 1000, 0}, {0, 0, -999}});
        PixelBuffer input = ConvolutionTestImages.filled(2, 2, 255, 0, 128, 1);
        input.set(0, 0, PixelBuffer.GREEN, 1);
        PixelBuffer output = PixelBuffer.allocate(2, 2);

        ConvolutionEngine.convolve(input, output, boost, 4);

        // (1000 - 999) * 255 = 255; зелёный (0,0): 1000 * 1 - 999 * 0 = 1000 -> 255
        assertEquals(255, output.get(1, 1, PixelBuffer.RED));
        assertEquals(255, output.get(0, 0, PixelBuffer.GREEN));
        assertEquals(0, output.get(1, 1, PixelBuffer.GREEN));
        assertEquals(128, output.get(0, 1, PixelBuffer.BLUE));
        assertEquals(1, output.get(1, 0, PixelBuffer.ALPHA));
    }

    @Test
    public void testWorkerFailureIsReported() {
        PixelBuffer input = ConvolutionTestImages.random(4, 4, 5);
        PixelBuffer output = PixelBuffer.allocate(4, 4);
        input.release();

        try {
            ConvolutionEngine.convolve(input, output, catalog.defaultKernel(), 2);
            fail("Ожидалось ConvolutionException");
        } catch (ConvolutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedDimensionsAreRejected() {
        ConvolutionEngine.convolve(PixelBuffer.allocate(2, 3), PixelBuffer.allocate(3, 2),
                catalog.defaultKernel(), 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroThreadsAreRejected() {
        ConvolutionEngine.convolve(PixelBuffer.allocate(2, 2), PixelBuffer.allocate(2, 2),
                catalog.defaultKernel(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInPlaceConvolutionIsRejected() {
        PixelBuffer buffer = PixelBuffer.allocate(2, 2);
        ConvolutionEngine.convolve(buffer, buffer, catalog.defaultKernel(), 1);
    }
}
