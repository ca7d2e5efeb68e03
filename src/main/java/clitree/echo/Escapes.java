package clitree.echo;

/**
 * Backslash escapes understood by {@code echo -e}.
 */
final class Escapes {
    private static final int MAX_CODE_POINT = 0x10FFFF;

    private Escapes() {
        throw new IllegalStateException("Util class");
    }

    /**
     * Appends {@code in} to {@code out} with escapes interpreted.
     *
     * @return true when {@code \c} was met and no further output must be produced
     */
    static boolean interpret(final String in, final StringBuilder out) {
        int j = 0;
        while (j < in.length()) {
            final char c = in.charAt(j);
            if (c != '\\' || j + 1 >= in.length()) {
                out.append(c);
                j++;
                continue;
            }

            final char e = in.charAt(++j);
            j++;
            switch (e) {
                case 'a':
                    out.append((char) 7);
                    break;
                case 'b':
                    out.append('\b');
                    break;
                case 'c':
                    return true;
                case 'e':
                case 'E':
                    out.append((char) 27);
                    break;
                case 'f':
                    out.append('\f');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'v':
                    out.append((char) 11);
                    break;
                case '\\':
                    out.append('\\');
                    break;
                case 'x': {
                    final int end = digits(in, j, 2, 16);
                    if (end == j) {
                        out.append("\\x");
                    } else {
                        out.append((char) Integer.parseInt(in.substring(j, end), 16));
                        j = end;
                    }
                    break;
                }
                case '0': {
                    final int end = digits(in, j, 3, 8);
                    out.append((char) (end == j ? 0 : Integer.parseInt(in.substring(j, end), 8)));
                    j = end;
                    break;
                }
                case 'u':
                case 'U': {
                    final int end = digits(in, j, e == 'u' ? 4 : 8, 16);
                    if (end == j) {
                        out.append('\\').append(e);
                    } else {
                        final long codePoint = Long.parseLong(in.substring(j, end), 16);
                        if (codePoint <= MAX_CODE_POINT) {
                            out.appendCodePoint((int) codePoint);
                        }
                        j = end;
                    }
                    break;
                }
                default:
                    out.append('\\').append(e);
                    break;
            }
        }
        return false;
    }

    private static int digits(final String in, final int start, final int max, final int radix) {
        int end = start;
        while (end < in.length() && end - start < max && Character.digit(in.charAt(end), radix) >= 0) {
            end++;
        }
        return end;
    }
}
