package org.iplocation.server.json;

@SuppressWarnings("serial")
public class EncodeException extends RuntimeException {

    public EncodeException(String message) {
        super(message);
    }
}
