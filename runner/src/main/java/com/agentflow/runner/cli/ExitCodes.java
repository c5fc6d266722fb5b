package com.agentflow.runner.cli;

final class ExitCodes {

    static final int OK    = 0;
    static final int FAIL  = 1;
    static final int USAGE = 2;

    private ExitCodes() {}
}
