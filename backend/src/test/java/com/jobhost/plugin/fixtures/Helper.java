package com.jobhost.plugin.fixtures;

public class Helper {

    public static String greet(String name) {
        return "hi " + name;
    }
}
