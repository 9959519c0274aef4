package cn.iinti.proxyfinder.exception;

public class ProxyFinderException extends RuntimeException {
    public ProxyFinderException(String message) {
        super(message);
    }

    public ProxyFinderException(String message, Throwable cause) {
        super(message, cause);
    }
}
