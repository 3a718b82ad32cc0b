package authz.modelgraph.cycle;

import java.util.List;

public record CycleReport(
        int totalCycles,
        int definitiveCount,
        int possibleCount,
        List<Cycle> cycles
) {
    public CycleReport {
        cycles = List.copyOf(cycles);
        if (definitiveCount + possibleCount != totalCycles) {
            throw new IllegalArgumentException("cycle counts do not add up: "
                    + definitiveCount + " + " + possibleCount + " != " + totalCycles);
        }
    }

    public static CycleReport of(List<Cycle> cycles) {
        int definitive = 0;
        for (Cycle c : cycles) {
            if (c.isDefinitive()) {
                definitive++;
            }
        }
        return new CycleReport(cycles.size(), definitive, cycles.size() - definitive, cycles);
    }

    public boolean hasCycles() {
        return totalCycles > 0;
    }

    public boolean hasDefinitiveCycles() {
        return definitiveCount > 0;
    }

    public List<Cycle> definitiveCycles() {
        return cycles.stream().filter(Cycle::isDefinitive).toList();
    }

    public List<Cycle> possibleCycles() {
        return cycles.stream().filter(c -> !c.isDefinitive()).toList();
    }
}
