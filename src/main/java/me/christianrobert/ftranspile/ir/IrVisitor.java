package me.christianrobert.ftranspile.ir;

/**
 * Visitor over the closed set of IR node kinds.
 */
public interface IrVisitor<R> {

    R visitSourceFile(SourceFile node);

    R visitModule(Module node);

    R visitSubroutine(Subroutine node);

    R visitSection(Section node);

    R visitComment(Comment node);

    R visitCommentBlock(CommentBlock node);

    R visitPragma(Pragma node);

    R visitPreprocessorDirective(PreprocessorDirective node);

    R visitIntrinsic(Intrinsic node);

    R visitImport(Import node);

    R visitDeclaration(Declaration node);

    R visitDataDeclaration(DataDeclaration node);

    R visitTypeDef(TypeDef node);

    R visitInterface(Interface node);

    R visitLoop(Loop node);

    R visitWhileLoop(WhileLoop node);

    R visitConditional(Conditional node);

    R visitMultiConditional(MultiConditional node);

    R visitMaskedStatement(MaskedStatement node);

    R visitAssignment(Assignment node);

    R visitCallStatement(CallStatement node);

    R visitAllocation(Allocation node);

    R visitDeallocation(Deallocation node);

    R visitNullify(Nullify node);

    R visitAssociate(Associate node);
}
