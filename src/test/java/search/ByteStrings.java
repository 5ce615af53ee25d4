package search;

public final class ByteStrings {
    private ByteStrings() {}

    // "0101" -> {0,1,0,1}; every char is taken as a digit.
    public static byte[] digits(String s) {
        byte[] out = new byte[s.length()];
        for (int i = 0; i < s.length(); i++) {
            out[i] = (byte) (s.charAt(i) - '0');
        }
        return out;
    }

    public static byte[] ascii(String s) {
        byte[] out = new byte[s.length()];
        for (int i = 0; i < s.length(); i++) {
            out[i] = (byte) s.charAt(i);
        }
        return out;
    }

    public static int naiveCount(byte[] pattern, byte[] text) {
        int count = 0;
        outer:
        for (int s = 0; s + pattern.length <= text.length; s++) {
            for (int i = 0; i < pattern.length; i++) {
                if (pattern[i] != text[s + i]) continue outer;
            }
            count++;
        }
        return count;
    }
}
