package com.bracketscan.application.markup;

/**
 * One document submitted for analysis.
 *
 * @param documentName name used in reports (nullable)
 * @param content      raw document text
 */
public record DocumentInput(String documentName, String content) {}
