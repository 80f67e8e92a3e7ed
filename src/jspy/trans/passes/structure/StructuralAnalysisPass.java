package jspy.trans.passes.structure;

import jspy.model.js.JSProgram;

import java.util.Collections;

/**
 * Single top-down traversal of the input tree that assigns loop ids, validates break and continue placement, and
 * collects per-function hoisting information. Throws the first structural issue it finds.
 */
public class StructuralAnalysisPass {
	private StructuralAnalysisPass() {}

	public static StructuralAnnotations perform(JSProgram program) {
		StructuralAnnotations annotations = new StructuralAnnotations();
		new StructuralAnalysisVisitor(annotations).visitFunctionRoot(program, program.getBody(),
				Collections.emptyList());
		return annotations;
	}
}
