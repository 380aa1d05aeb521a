package com.questrail.keycode.registry.catalog;

import com.questrail.keycode.api.Keycode;

import java.util.ArrayList;
import java.util.List;

final class Catalogs
{
    private Catalogs() {
    }

    @SafeVarargs
    static List<Keycode> concat(List<Keycode>... parts) {
        List<Keycode> all = new ArrayList<>();
        for (List<Keycode> part : parts) {
            all.addAll(part);
        }
        return List.copyOf(all);
    }
}
