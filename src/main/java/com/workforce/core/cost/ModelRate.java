package com.workforce.core.cost;

/**
 * USD price per one million tokens for a model.
 */
public class ModelRate {

    private double input;
    private double output;

    public ModelRate() {
    }

    public ModelRate(double input, double output) {
        this.input = input;
        this.output = output;
    }

    public double getInput() {
        return input;
    }

    public void setInput(double input) {
        this.input = input;
    }

    public double getOutput() {
        return output;
    }

    public void setOutput(double output) {
        this.output = output;
    }
}
