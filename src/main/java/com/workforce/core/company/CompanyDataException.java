package com.workforce.core.company;

/**
 * Company data exists but cannot be read or describes an invalid hierarchy.
 */
public class CompanyDataException extends RuntimeException {

    public CompanyDataException(String message) {
        super(message);
    }

    public CompanyDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
