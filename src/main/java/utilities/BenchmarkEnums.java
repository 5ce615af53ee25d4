package utilities;

import java.util.EnumSet;
import java.util.Locale;

public final class BenchmarkEnums {
    private BenchmarkEnums() {}

    public enum AlgorithmType {
        GAMMA_SKIP("GammaSkip", "gskip", "gammaskip"),
        TVSBS_W4("TVSBS-w4", "tvsbs-w4", "tvsbs"),
        BRUTE_FORCE("BruteForce", "bf", "naive");

        private final String displayName;
        private final String token;
        private final String alias;

        AlgorithmType(String displayName, String token, String alias) {
            this.displayName = displayName;
            this.token = token;
            this.alias = alias;
        }

        public String displayName() { return displayName; }
        public String token() { return token; }

        public static AlgorithmType fromString(String value) {
            String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
            return EnumSet.allOf(AlgorithmType.class).stream()
                    .filter(type -> type.token.equals(v) || type.alias.equals(v))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + value));
        }
    }

    public enum AlphabetMode {
        FIXED_BINARY("binary"),
        DERIVED("derived");

        private final String token;
        AlphabetMode(String token) { this.token = token; }
        public String token() { return token; }

        public static AlphabetMode fromString(String value) {
            return EnumSet.allOf(AlphabetMode.class).stream()
                    .filter(mode -> mode.token.equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown alphabet mode: " + value));
        }
    }

    public enum Distribution {
        UNIFORM("uniform"),
        ZIPF("zipf");

        private final String token;
        Distribution(String token) { this.token = token; }
        public String token() { return token; }

        public static Distribution fromString(String value) {
            return EnumSet.allOf(Distribution.class).stream()
                    .filter(d -> d.token.equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown distribution: " + value));
        }
    }
}
