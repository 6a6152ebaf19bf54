package com.elime.service;

/**
 * Asks the operator a question and returns the typed answer.
 */
public interface OperatorPrompt {

    String ask(String question);
}
