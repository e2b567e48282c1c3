package com.nyct.routemaps;

@FunctionalInterface
interface RowParser<T> {
    T parse(TableRecord record) throws RowParseException;
}
