package me.christianrobert.ftranspile.frontend.builder;

import me.christianrobert.ftranspile.antlr.FortranParser;
import me.christianrobert.ftranspile.ir.Comment;
import me.christianrobert.ftranspile.ir.Import;
import me.christianrobert.ftranspile.ir.Node;
import me.christianrobert.ftranspile.ir.Pragma;
import me.christianrobert.ftranspile.ir.PreprocessorDirective;
import me.christianrobert.ftranspile.ir.Source;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static helper for comment lines, pragmas, preprocessor lines and includes.
 *
 * <ul>
 *   <li>{@code !$keyword content} becomes a {@link Pragma} ({@code !$omp parallel}, {@code !$acc ...})</li>
 *   <li>any other {@code !} line becomes a {@link Comment}</li>
 *   <li>{@code #include "file"} becomes a C {@link Import}, other {@code #} lines a {@link PreprocessorDirective}</li>
 *   <li>{@code INCLUDE 'file'} becomes a Fortran {@link Import}</li>
 * </ul>
 */
public class VisitDirective {

    private static final Pattern PRAGMA = Pattern.compile("^\\s*!\\$(\\w+)\\s*(.*)$");
    private static final Pattern C_INCLUDE = Pattern.compile("^#\\s*include\\s*[\"<]([^\">]+)[\">].*$");

    public static List<Node> comment(FortranParser.CommentStmtContext ctx, IrBuilder b) {
        String raw = ctx.COMMENT_LINE().getText();
        Source source = b.text().source(ctx);
        Matcher pragma = PRAGMA.matcher(raw);
        if (pragma.matches()) {
            return List.of(new Pragma(pragma.group(1).toLowerCase(Locale.ROOT), pragma.group(2).trim(), source));
        }
        return List.of(new Comment(raw.trim(), source));
    }

    public static List<Node> preprocessor(FortranParser.PpDirectiveContext ctx, IrBuilder b) {
        String raw = ctx.PP_DIRECTIVE().getText().trim();
        Source source = b.text().source(ctx);
        Matcher include = C_INCLUDE.matcher(raw);
        if (include.matches()) {
            return List.of(new Import(include.group(1), List.of(), false, true, false, source, null));
        }
        return List.of(new PreprocessorDirective(raw, source));
    }

    public static List<Node> include(FortranParser.IncludeStmtContext ctx, IrBuilder b) {
        String file = VisitLiteralConstant.unquote(ctx.STRING_LITERAL().getText());
        return List.of(new Import(file, List.of(), false, false, true, b.text().source(ctx), b.text().label(ctx)));
    }
}
