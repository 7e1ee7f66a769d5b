package org.lokray.toybeam.exception;

/**
 * Stable, machine-matchable classification of every compile failure.
 * Each kind belongs to exactly one pipeline {@link Stage}.
 */
public enum ErrorKind
{
	// Lexical
	UNTERMINATED_STRING(Stage.LEX),
	UNTERMINATED_COMMENT(Stage.LEX),
	INVALID_ESCAPE(Stage.LEX),
	INVALID_CHARACTER(Stage.LEX),

	// Syntactic
	UNEXPECTED_TOKEN(Stage.PARSE),
	UNEXPECTED_END_OF_INPUT(Stage.PARSE),
	AMBIGUOUS_CONSTRUCT(Stage.PARSE),

	// Semantic
	UNDEFINED_VARIANT(Stage.SEMANTIC),
	ARITY_MISMATCH(Stage.SEMANTIC),
	DUPLICATE_BINDING(Stage.SEMANTIC),
	UNDEFINED_FUNCTION_CALL(Stage.SEMANTIC),
	UNDEFINED_TYPE(Stage.SEMANTIC),
	UNDEFINED_FIELD(Stage.SEMANTIC),
	UNDEFINED_VARIABLE(Stage.SEMANTIC),

	// Code generation
	UNSUPPORTED_CONSTRUCT(Stage.CODEGEN),
	CONFLICTING_BITSTRING_SPECIFIER(Stage.CODEGEN);

	public enum Stage
	{
		LEX, PARSE, SEMANTIC, CODEGEN
	}

	private final Stage stage;

	ErrorKind(Stage stage)
	{
		this.stage = stage;
	}

	public Stage getStage()
	{
		return stage;
	}
}
