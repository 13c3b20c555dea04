package com.plang.ast;

/**
 * A statement inside a policy body.
 */
public sealed interface Statement permits WhenStatement, ActionStatement {

    /**
     * Source line where the statement starts.
     */
    int line();
}
