package utilities;

import utilities.BenchmarkEnums.AlgorithmType;
import utilities.BenchmarkEnums.AlphabetMode;
import utilities.BenchmarkEnums.Distribution;

import java.util.*;
import java.util.stream.Collectors;

// Parsed options for the matcher benchmark driver.
public record BenchmarkOptions(
        List<AlgorithmType> algorithms,
        int textLength,
        List<Integer> patternLengths,
        int runs,
        AlphabetMode alphabetMode,
        int sigma,                   // symbols generated in DERIVED mode, starting at minChar
        int minChar,
        long seed,
        Distribution distribution,
        double zipfExponent,
        boolean memoryReport) {

    public static BenchmarkOptions defaults() {
        return parse(new String[0]);
    }

    public static BenchmarkOptions parse(String[] args) {
        List<AlgorithmType> algorithms = List.of(AlgorithmType.GAMMA_SKIP, AlgorithmType.TVSBS_W4);
        int textLength = 1 << 20;
        List<Integer> patternLengths = List.of(2, 4, 8, 16, 32, 64, 128, 256, 512, 1024);
        int runs = 10;
        AlphabetMode alphabetMode = AlphabetMode.FIXED_BINARY;
        int sigma = 4;
        int minChar = 0;
        long seed = 42L;
        Distribution distribution = Distribution.UNIFORM;
        double zipfExponent = 1.0;
        boolean memoryReport = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) continue;
            String key; String value;
            int eq = arg.indexOf('=');
            if (eq >= 0) { key = arg.substring(2, eq); value = arg.substring(eq + 1);} else {
                key = arg.substring(2);
                if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option --" + key);
                value = args[++i];
            }

            switch (key) {
                case "algorithms", "algorithm", "algo" -> algorithms = parseAlgorithms(value);
                case "text-length", "n" -> textLength = Integer.parseInt(value);
                case "pattern-lengths", "m" -> patternLengths = parseIntCsv(value);
                case "runs" -> runs = Integer.parseInt(value);
                case "alphabet" -> alphabetMode = AlphabetMode.fromString(value);
                case "sigma" -> sigma = Integer.parseInt(value);
                case "min-char" -> minChar = Integer.parseInt(value);
                case "seed" -> seed = Long.parseLong(value);
                case "distribution", "dist" -> distribution = Distribution.fromString(value);
                case "zipf-exponent", "exponent" -> zipfExponent = Double.parseDouble(value);
                case "memory", "mem" -> memoryReport = Boolean.parseBoolean(value);
                default -> throw new IllegalArgumentException("Unknown option --" + key);
            }
        }

        if (algorithms.isEmpty()) throw new IllegalArgumentException("At least one algorithm must be enabled");
        if (textLength < 1) throw new IllegalArgumentException("--text-length must be positive");
        if (runs < 1) throw new IllegalArgumentException("--runs must be positive");
        if (patternLengths.isEmpty()) throw new IllegalArgumentException("Empty --pattern-lengths list");
        for (int m : patternLengths) {
            if (m < 1) throw new IllegalArgumentException("pattern lengths must be positive: " + m);
        }
        if (alphabetMode == AlphabetMode.FIXED_BINARY) {
            sigma = 2;
            minChar = 0;
        }
        if (sigma < 1) throw new IllegalArgumentException("--sigma must be positive");
        if (minChar < 0 || minChar + sigma - 1 > 255) {
            throw new IllegalArgumentException("symbol range [" + minChar + "," + (minChar + sigma - 1) + "] must lie in [0,255]");
        }
        if (distribution == Distribution.ZIPF && !(zipfExponent > 0.0)) {
            throw new IllegalArgumentException("--zipf-exponent must be > 0");
        }

        patternLengths = patternLengths.stream().distinct().sorted().collect(Collectors.toUnmodifiableList());

        return new BenchmarkOptions(
                List.copyOf(algorithms),
                textLength,
                patternLengths,
                runs,
                alphabetMode,
                sigma,
                minChar,
                seed,
                distribution,
                zipfExponent,
                memoryReport);
    }

    public int maxChar() {
        return minChar + sigma - 1;
    }

    private static List<AlgorithmType> parseAlgorithms(String value) {
        if ("all".equalsIgnoreCase(value.trim())) {
            return List.of(AlgorithmType.values());
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(AlgorithmType::fromString)
                .distinct()
                .collect(Collectors.toList());
    }

    private static List<Integer> parseIntCsv(String value) {
        List<Integer> out = new ArrayList<>();
        for (String part : value.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            out.add(Integer.parseInt(t));
        }
        return out;
    }
}
