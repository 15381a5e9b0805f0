package de.recon.diagnosis.rules.condition;

import de.recon.diagnosis.model.TradeRow;

import java.util.Set;

public interface Condition {

    boolean test(TradeRow row);

    Set<String> fields();

    static Condition parse(String source) {
        return new ConditionParser(source).parse();
    }
}
