package com.example.widgets;

import java.util.function.Function;
import java.util.function.Supplier;

public class Widget {

    static final Supplier<Widget> FACTORY = () -> new Widget();

    static final Function<String, Widget> KEYED = k -> {
        return withKey(k);
    };

    static final Class<Widget> TYPE = Widget.class;

    private final String key;

    public Widget() {
        this(null);
    }

    private Widget(String key) {
        this.key = key;
    }

    public static Widget withKey(String key) {
        return new Widget(key);
    }

    static Widget create(String key) {
        return Widget.withKey(key);
    }

    String key() {
        return key;
    }
}
