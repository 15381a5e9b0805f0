package de.recon.diagnosis.classifier;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

public final class LabelEncoder {

    private final List<String> labels;
    private final Map<String, Integer> index;

    private LabelEncoder(List<String> labels) {
        this.labels = List.copyOf(labels);
        this.index = new HashMap<>();
        for (int i = 0; i < this.labels.size(); i++) {
            if (index.put(this.labels.get(i), i) != null) {
                throw new ModelStateException("Label encoder has duplicate label " + this.labels.get(i));
            }
        }
    }

    public static LabelEncoder fit(Collection<String> labels) {
        return new LabelEncoder(List.copyOf(new TreeSet<>(labels)));
    }

    public static LabelEncoder restore(List<String> labels) {
        return new LabelEncoder(labels);
    }

    public int encode(String label) {
        Integer i = index.get(label);
        if (i == null) {
            throw new IllegalArgumentException("Label not in encoder: " + label);
        }
        return i;
    }

    public String decode(int classIndex) {
        if (classIndex < 0 || classIndex >= labels.size()) {
            throw new ModelStateException("Class index " + classIndex + " has no label (encoder size "
                    + labels.size() + ")");
        }
        return labels.get(classIndex);
    }

    public boolean contains(String label) {
        return index.containsKey(label);
    }

    public int size() {
        return labels.size();
    }

    public List<String> labels() {
        return labels;
    }
}
