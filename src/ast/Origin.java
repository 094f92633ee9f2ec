package ast;

/**
 * One low-level construct a statement or expression was derived from.
 *
 * @param unit name of the input the construct was read from
 * @param line 1-based line of the construct
 * @param text the construct as written in the input
 */
public record Origin(String unit, int line, String text) {
    @Override
    public String toString() {
        return unit + ":" + line + " `" + text + "`";
    }
}
