package com.reflector.fixtures;

import java.util.List;

public class Category {

    private String name;

    private List<Category> children;
}
