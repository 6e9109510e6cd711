package me.christianrobert.ftranspile.codegen.fortran;

import me.christianrobert.ftranspile.codegen.CodeMapper;

import java.util.List;

/**
 * Fortran spelling of expressions: dotted logical operators, {@code /=} for inequality,
 * {@code (/ ... /)} array constructors and kind suffixes on literals.
 */
public class FortranCodeMapper extends CodeMapper {

    @Override
    protected String logicLiteral(boolean value, String kind) {
        return (value ? ".true." : ".false.") + kindSuffix(kind);
    }

    @Override
    protected String literalList(List<String> elements) {
        return "(/ " + String.join(", ", elements) + " /)";
    }

    @Override
    protected String comparisonOperator(String operator) {
        return operator.equals("!=") ? "/=" : operator;
    }
}
