package com.nyct.routemaps;

class RowParseException extends Exception {
    RowParseException(String message) {
        super(message);
    }
}
