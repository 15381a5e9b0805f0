package de.recon.diagnosis.rules;

import de.recon.diagnosis.DiagnosisException;

public class RuleConditionException extends DiagnosisException {

    private final String condition;
    private final int position;

    public RuleConditionException(String condition, int position, String message) {
        super(message + " at position " + position + " in condition [" + condition + "]");
        this.condition = condition;
        this.position = position;
    }

    public RuleConditionException(String condition, String message, Throwable cause) {
        super(message + " in condition [" + condition + "]", cause);
        this.condition = condition;
        this.position = -1;
    }

    public String getCondition() {
        return condition;
    }

    public int getPosition() {
        return position;
    }
}
