package de.bsommerfeld.canvas.ui.view.account;

/**
 * Text shown in a dialog's status line.
 */
public record StatusMessage(String text, Severity severity) {

    public enum Severity {
        INFO,
        SUCCESS,
        ERROR
    }

    public static final StatusMessage NONE = new StatusMessage("", Severity.INFO);

    public static StatusMessage info(String text) {
        return new StatusMessage(text, Severity.INFO);
    }

    public static StatusMessage success(String text) {
        return new StatusMessage(text, Severity.SUCCESS);
    }

    public static StatusMessage error(String text) {
        return new StatusMessage(text, Severity.ERROR);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
