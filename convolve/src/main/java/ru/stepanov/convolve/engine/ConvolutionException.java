package ru.stepanov.convolve.engine;

public class ConvolutionException extends RuntimeException {

    public ConvolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
