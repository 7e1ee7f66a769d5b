package org.lokray.toybeam.ast.types;

import org.lokray.toybeam.lexer.Token;

/**
 * A parsed type annotation. Annotations are kept on the AST for tooling but are
 * erased by the compiler: nothing downstream of the parser interprets them.
 */
public interface TypeAnnotation
{
	Token getFirstToken();
}
