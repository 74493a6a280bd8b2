package dev.dataprep.error;

public class DatasetNotFoundException extends DataPrepException {

    public DatasetNotFoundException(String name) {
        super("Dataset not found: " + name);
    }
}
