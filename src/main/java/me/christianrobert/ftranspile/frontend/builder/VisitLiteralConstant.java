package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.expression.Expression;
import me.christianrobert.ftranspile.expression.FloatLiteral;
import me.christianrobert.ftranspile.expression.IntLiteral;
import me.christianrobert.ftranspile.expression.IntrinsicLiteral;
import me.christianrobert.ftranspile.expression.LogicLiteral;
import me.christianrobert.ftranspile.expression.StringLiteral;

/**
 * Static helper for lowering literal constants.
 *
 * <p>Kind suffixes ({@code 1.0_jprb}, {@code 8_jpim}, {@code .true._lk}) are split off and
 * kept as the literal's kind. Integer literals too large for a {@code long} are kept
 * verbatim as an {@link IntrinsicLiteral}.</p>
 */
public class VisitLiteralConstant {

    public static Expression v(FortranParser.LiteralConstantContext ctx) {
        String raw = ctx.getText();

        if (ctx.INT_LITERAL() != null) {
            String[] parts = splitKind(raw);
            try {
                return new IntLiteral(Long.parseLong(parts[0]), parts[1]);
            } catch (NumberFormatException e) {
                return new IntrinsicLiteral(raw);
            }
        }
        if (ctx.REAL_LITERAL() != null) {
            String[] parts = splitKind(raw);
            return new FloatLiteral(parts[0], parts[1]);
        }
        if (ctx.STRING_LITERAL() != null) {
            return new StringLiteral(unquote(raw));
        }
        String[] parts = splitKind(raw);
        return new LogicLiteral(ctx.TRUE() != null, parts[1]);
    }

    /**
     * Splits {@code value_kind} at the first underscore; the kind part is null if absent.
     */
    static String[] splitKind(String raw) {
        int idx = raw.indexOf('_');
        if (idx < 0) {
            return new String[] {raw, null};
        }
        return new String[] {raw.substring(0, idx), raw.substring(idx + 1)};
    }

    /**
     * Strips the delimiters and collapses doubled delimiters inside the string.
     */
    static String unquote(String raw) {
        char quote = raw.charAt(0);
        String body = raw.substring(1, raw.length() - 1);
        String doubled = String.valueOf(quote) + quote;
        return body.replace(doubled, String.valueOf(quote));
    }
}
