package com.bracketscan.domain.markup.model;

public enum ValidatorType {
    DELIMITER,
    COMMENT,
    ELEMENT_SEQUENCE
}
