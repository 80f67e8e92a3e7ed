package jspy.trans.passes.codegen;

import jspy.model.js.JSProgram;
import jspy.model.py.builder.PyBlockBuilder;
import jspy.trans.TranslationOptions;
import jspy.trans.passes.structure.StructuralAnnotations;

public class PythonCodeGenPass {
	private PythonCodeGenPass() {}

	public static TranslationResult perform(StructuralAnnotations annotations, JSProgram program,
	                                        TranslationOptions options) {
		CodeGenContext ctx = new CodeGenContext(annotations, options);
		ctx.getTemps().reset();
		PyBlockBuilder body = PyBlockBuilder.detached();
		new JSStatementCodeGenVisitor(ctx, body).translateFunctionRoot(program, program.getBody(), false);
		return new TranslationResult(body.getStatements(), ctx.getSymbols());
	}
}
