package com.questrail.menton.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registers
 * -----------------------------------------------------------------------------
 * The fixed register universe.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>Indices 0-8: the named registers, in {@link #NAMED} order</li>
 *   <li>Indices 9-57: patterned registers {@code A가B가}, with A and B taken
 *       from {@link #PATTERN_SYLLABLES}, A varying slowest</li>
 * </ul>
 *
 * <p>{@code 멘똔} (index 0) is selected when a run starts.</p>
 */
public final class Registers
{
    public static final List<String> NAMED = List.of(
            "멘똔",
            "배털",
            "정빵",
            "애플리프트",
            "깨무이",
            "혁두",
            "턱살개구리",
            "잉진이",
            "민짜이");

    public static final List<String> PATTERN_SYLLABLES = List.of("멘", "빵", "깨", "털", "두", "덜", "애");
    public static final String PATTERN_GLUE = "가";

    private static final List<Register> ALL;
    private static final Map<String, Register> BY_TOKEN;

    static {
        List<Register> all = new ArrayList<>();
        for (String name : NAMED) {
            all.add(new Register(all.size(), name));
        }
        for (String a : PATTERN_SYLLABLES) {
            for (String b : PATTERN_SYLLABLES) {
                all.add(new Register(all.size(), a + PATTERN_GLUE + b + PATTERN_GLUE));
            }
        }

        Map<String, Register> byToken = new HashMap<>();
        for (Register register : all) {
            if (byToken.put(register.token(), register) != null) {
                throw new IllegalStateException("Duplicate register token: " + register.token());
            }
        }

        ALL = Collections.unmodifiableList(all);
        BY_TOKEN = Collections.unmodifiableMap(byToken);
    }

    private Registers() {}

    /**
     * Returns the register selected at the start of every run.
     */
    public static Register initial() {
        return ALL.get(0);
    }

    /**
     * Returns all registers in index order.
     */
    public static List<Register> all() {
        return ALL;
    }

    public static int count() {
        return ALL.size();
    }

    /**
     * Looks up a register by its exact token.
     */
    public static Optional<Register> lookup(String token) {
        return Optional.ofNullable(BY_TOKEN.get(token));
    }
}
