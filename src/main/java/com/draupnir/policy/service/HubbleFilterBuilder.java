package com.draupnir.policy.service;

import com.draupnir.policy.model.api.HubbleFilter;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns source/destination/verdict selectors into a {@code hubble observe} command line.
 * Only builds text; nothing is executed.
 */
public class HubbleFilterBuilder {

    public HubbleFilter build(String src, String dst, String verdict) {
        List<String> args = new ArrayList<>();
        addArg(args, "--from", src);
        addArg(args, "--to", dst);
        addArg(args, "--verdict", verdict);

        return HubbleFilter.builder()
                .cli("hubble observe " + String.join(" ", args))
                .filters(HubbleFilter.Filters.builder()
                        .from(emptyToNull(src))
                        .to(emptyToNull(dst))
                        .verdict(emptyToNull(verdict))
                        .build())
                .build();
    }

    private static void addArg(List<String> args, String flag, String value) {
        if (value != null && !value.isEmpty()) {
            args.add(flag);
            args.add(value);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
