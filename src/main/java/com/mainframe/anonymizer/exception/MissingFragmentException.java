package com.mainframe.anonymizer.exception;

/**
 * A COPY statement names a copybook that no file of the batch declares.
 */
public class MissingFragmentException extends AnonymizerException {

    private static final long serialVersionUID = 1L;
    private final String fragmentName;
    private final String consumerFile;
    private final int line;

    public MissingFragmentException(String fragmentName, String consumerFile, int line) {
        super("Copybook not found: " + fragmentName + " (referenced in " + consumerFile + ":" + line + ")");
        this.fragmentName = fragmentName;
        this.consumerFile = consumerFile;
        this.line = line;
    }

    public String getFragmentName() {
        return fragmentName;
    }

    public String getConsumerFile() {
        return consumerFile;
    }

    public int getLine() {
        return line;
    }
}
