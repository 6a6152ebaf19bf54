package com.elime.ui;

import com.elime.service.OperatorPrompt;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Asks on standard output and reads one line from standard input.
 */
@Component
public class ConsoleOperatorPrompt implements OperatorPrompt {

    private final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    @Override
    public String ask(String question) {
        System.out.print(question + " ");
        System.out.flush();
        try {
            String line = in.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read answer", e);
        }
    }
}
