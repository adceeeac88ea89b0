package com.example.diag;

import java.util.List;

public class Broken {

    // TODO: replace once the type exists
    MissingType field;

    int answer() {
        return 42;
    }
}
