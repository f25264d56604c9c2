package org.springaicommunity.github.importer.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.springaicommunity.github.importer.ConfirmationPrompt;

/**
 * Asks for confirmation on the terminal. Anything but {@code y} or {@code yes}, including
 * end of input, declines.
 */
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

	private final BufferedReader in;

	private final PrintStream out;

	public ConsoleConfirmationPrompt() {
		this(System.in, System.out);
	}

	ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
		this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		this.out = out;
	}

	@Override
	public boolean confirm(String message) {
		out.print(message + " [y/N] ");
		out.flush();
		try {
			String answer = in.readLine();
			if (answer == null) {
				return false;
			}
			answer = answer.trim().toLowerCase(Locale.ROOT);
			return answer.equals("y") || answer.equals("yes");
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read confirmation", e);
		}
	}

}
