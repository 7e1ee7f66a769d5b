package org.lokray.toybeam.patterns;

import org.lokray.toybeam.codegen.CoreErlang;
import org.lokray.toybeam.codegen.HygieneContext;
import org.lokray.toybeam.exception.CompileException;

import java.util.List;

/**
 * Dispatch on the mailbox: a {@code receive} that takes the first message matching some arm
 * and leaves the others queued. There is no catch-all; the after clause always closes the
 * construct, waiting forever when no timeout was given.
 */
public class MailboxDispatch implements DispatchStrategy
{
	public static final String INFINITY = "'infinity'";

	private final String timeout;
	private final ClauseBody timeoutBody;

	/**
	 * @param timeout     A variable or constant holding the timeout in milliseconds.
	 * @param timeoutBody What to evaluate when the timeout expires.
	 */
	public MailboxDispatch(String timeout, ClauseBody timeoutBody)
	{
		this.timeout = timeout;
		this.timeoutBody = timeoutBody;
	}

	public static MailboxDispatch forever()
	{
		return new MailboxDispatch(INFINITY, () -> CoreErlang.TRUE);
	}

	@Override
	public int width()
	{
		return 1;
	}

	@Override
	public String assemble(List<String> clauses, HygieneContext hygiene) throws CompileException
	{
		return CoreErlang.receive(clauses, timeout, timeoutBody.lower());
	}
}
