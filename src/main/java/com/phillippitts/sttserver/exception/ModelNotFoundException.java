package com.phillippitts.sttserver.exception;

/**
 * Thrown when the configured model artifact is missing, has the wrong shape for the selected
 * engine (file vs. directory), or fails to load.
 *
 * <p>This is a startup-only fault: the application refuses to serve requests without a loaded model.
 */
public class ModelNotFoundException extends SttServerException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("STT model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, String detail) {
        super(detail + ": " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, String detail, Throwable cause) {
        super(detail + ": " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
