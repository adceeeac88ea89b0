package com.example.loose;

public class Loose {

    static Loose create() {
        return new Loose();
    }
}
