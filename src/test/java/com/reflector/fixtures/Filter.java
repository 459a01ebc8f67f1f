package com.reflector.fixtures;

public class Filter {

    private String field;

    private String value;
}
