package ru.stepanov.convolve.image;

import java.io.IOException;

public class ImageCodecException extends IOException {

    public ImageCodecException(String message) {
        super(message);
    }

    public ImageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
