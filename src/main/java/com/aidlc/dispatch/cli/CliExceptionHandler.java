package com.aidlc.dispatch.cli;

import com.aidlc.core.store.MalformedRecordException;
import com.aidlc.core.store.RecordPathException;
import com.aidlc.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Maps exceptions escaping a command to exit codes: bad records or ids are input errors (2),
 * version-control failures are operational failures (1). Anything else propagates.
 */
public class CliExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) throws Exception {
        if (ex instanceof MalformedRecordException || ex instanceof RecordPathException) {
            ConsoleOutput.error(ex.getMessage());
            return AidlcCommand.BAD_INPUT;
        }
        if (ex instanceof VcsException vcs) {
            log.debug("VCS operation {} failed", vcs.operation(), vcs);
            ConsoleOutput.error(vcs.operation() + ": " + vcs.getMessage());
            return AidlcCommand.FAILED;
        }
        throw ex;
    }
}
