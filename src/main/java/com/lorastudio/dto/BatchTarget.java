package com.lorastudio.dto;

/**
 * How many images a batch would caption, with the label shown on the batch
 * button.
 */
public class BatchTarget {

    private final int count;
    private final String label;
    private final String mode;

    public BatchTarget(int count, String label, String mode) {
        this.count = count;
        this.label = label;
        this.mode = mode;
    }

    public int getCount() {
        return count;
    }

    public String getLabel() {
        return label;
    }

    public String getMode() {
        return mode;
    }
}
