package dev.dataprep.error;

public class UnknownSinkTypeException extends DataPrepException {

    public UnknownSinkTypeException(String sinkType) {
        super("Unknown sink type: " + sinkType);
    }
}
