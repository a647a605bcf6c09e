package ru.stepanov.convolve.cli;

public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
