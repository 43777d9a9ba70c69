package org.lokray.ferra;

import org.lokray.ferra.ast.CompilationUnit;
import org.lokray.ferra.diagnostics.DiagnosticCode;
import org.lokray.ferra.lexer.Lexer;
import org.lokray.ferra.lexer.LexicalAbortException;
import org.lokray.ferra.lexer.SourceSpan;
import org.lokray.ferra.lexer.Token;
import org.lokray.ferra.parser.FerraParser;
import org.lokray.ferra.util.Debug;
import org.lokray.ferra.util.ErrorReporter;
import org.lokray.ferra.util.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the Ferra front end: scans and parses a source buffer into a
 * {@link ParseResult}. Every call works on its own lexer, parser and diagnostics, so one
 * instance can be shared between threads.
 */
public class FerraFrontEnd
{
	private static final Logger log = LoggerFactory.getLogger(FerraFrontEnd.class);

	private final ParserConfig config;

	/**
	 * Creates a front end configured from {@code ferra-parser.properties} and system properties.
	 */
	public FerraFrontEnd()
	{
		this(ParserConfig.load());
	}

	public FerraFrontEnd(ParserConfig config)
	{
		this.config = Objects.requireNonNull(config, "config");
		if (config.isTraceEnabled())
		{
			Debug.setEnabled(true);
		}
	}

	public ParserConfig getConfig()
	{
		return config;
	}

	/**
	 * Parses a source buffer.
	 *
	 * @param sourceName The name of the source, used in rendered diagnostics.
	 * @param source     The source text.
	 * @return The AST with every diagnostic found.
	 */
	public ParseResult parse(String sourceName, String source)
	{
		Objects.requireNonNull(sourceName, "sourceName");
		Objects.requireNonNull(source, "source");
		ErrorReporter reporter = new ErrorReporter(config.getMaxDiagnostics());
		Lexer lexer = new Lexer(source, reporter, config);
		List<Token> tokens;
		try
		{
			tokens = lexer.scanTokens();
		}
		catch (LexicalAbortException e)
		{
			log.debug("Scanning {} aborted: {}", sourceName, e.getMessage());
			return aborted(sourceName, reporter);
		}
		log.debug("Scanned {} tokens from {}", tokens.size(), sourceName);

		FerraParser parser = new FerraParser(tokens, lexer.getTerminatorResolver(), reporter, config);
		CompilationUnit unit = parser.parse();
		boolean truncated = parser.isTruncated() || reporter.isLimitReached();
		log.debug("Parsed {}: {} statements, {} diagnostics", sourceName, unit.getStatements().size(), reporter.size());
		return new ParseResult(sourceName, unit, reporter.getDiagnostics(), tokens, lexer.getTerminatorResolver(),
				false, truncated, parser.getArena().size());
	}

	/**
	 * Parses a UTF-8 encoded source buffer. Input that is not valid UTF-8 aborts the pass with L004.
	 */
	public ParseResult parse(String sourceName, byte[] source)
	{
		Objects.requireNonNull(sourceName, "sourceName");
		Objects.requireNonNull(source, "source");
		ErrorReporter reporter = new ErrorReporter(config.getMaxDiagnostics());
		String text = decode(source, reporter);
		if (text == null)
		{
			return aborted(sourceName, reporter);
		}
		return parse(sourceName, text);
	}

	/**
	 * Scans a source buffer without parsing it, for tooling such as syntax highlighting.
	 * The result carries the tokens and the lexical diagnostics but no AST.
	 */
	public ParseResult tokenize(String sourceName, String source)
	{
		Objects.requireNonNull(sourceName, "sourceName");
		Objects.requireNonNull(source, "source");
		ErrorReporter reporter = new ErrorReporter(config.getMaxDiagnostics());
		Lexer lexer = new Lexer(source, reporter, config);
		try
		{
			List<Token> tokens = lexer.scanTokens();
			return new ParseResult(sourceName, null, reporter.getDiagnostics(), tokens, lexer.getTerminatorResolver(),
					false, reporter.isLimitReached(), 0);
		}
		catch (LexicalAbortException e)
		{
			log.debug("Scanning {} aborted: {}", sourceName, e.getMessage());
			return aborted(sourceName, reporter);
		}
	}

	private static ParseResult aborted(String sourceName, ErrorReporter reporter)
	{
		return new ParseResult(sourceName, null, reporter.getDiagnostics(), List.of(), null, true, false, 0);
	}

	/**
	 * Decodes strict UTF-8. On a malformed sequence an L004 diagnostic is reported at its byte
	 * offset and null is returned.
	 */
	private static String decode(byte[] source, ErrorReporter reporter)
	{
		CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
		ByteBuffer in = ByteBuffer.wrap(source);
		CharBuffer out = CharBuffer.allocate(source.length + 1);
		CoderResult result = decoder.decode(in, out, true);
		if (!result.isError())
		{
			result = decoder.flush(out);
		}
		if (result.isError())
		{
			int offset = in.position();
			int line = 1;
			int column = 1;
			out.flip();
			while (out.hasRemaining())
			{
				if (out.get() == '\n')
				{
					line++;
					column = 1;
				}
				else
				{
					column++;
				}
			}
			String message = "Invalid UTF-8 byte sequence at offset " + offset;
			try
			{
				result.throwException();
			}
			catch (CharacterCodingException e)
			{
				message = message + " (" + e.getMessage() + ")";
			}
			reporter.report(DiagnosticCode.L004, new SourceSpan(offset, offset + result.length(), line, column), message);
			log.debug(message);
			return null;
		}
		out.flip();
		return out.toString();
	}
}
