package fr.lapetina.modeltraffic.rollout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits an integer amount of traffic across endpoints in proportion to reference weights,
 * using the largest remainder method so the parts always add up to the total.
 */
public final class WeightPlanner {

    private WeightPlanner() {
    }

    /**
     * @param total      amount to distribute, 0..100
     * @param proportions reference weights per endpoint id; equal shares when they are all zero
     * @return weights per endpoint id, in id order, summing to {@code total}
     */
    public static Map<String, Integer> split(int total, Map<String, Integer> proportions) {
        if (total < 0) {
            throw new IllegalArgumentException("Total must be non-negative: " + total);
        }
        Map<String, Integer> sorted = new TreeMap<>(proportions);
        Map<String, Integer> result = new LinkedHashMap<>();
        if (sorted.isEmpty()) {
            if (total != 0) {
                throw new IllegalArgumentException("Cannot split " + total + " across no endpoint");
            }
            return result;
        }

        long sum = sorted.values().stream().mapToLong(Integer::longValue).sum();
        List<Share> shares = new ArrayList<>();
        int assigned = 0;
        for (Map.Entry<String, Integer> entry : sorted.entrySet()) {
            double exact = sum == 0
                    ? (double) total / sorted.size()
                    : (double) total * entry.getValue() / sum;
            int floor = (int) Math.floor(exact);
            shares.add(new Share(entry.getKey(), floor, exact - floor));
            assigned += floor;
        }

        int leftover = total - assigned;
        List<Share> byRemainder = new ArrayList<>(shares);
        byRemainder.sort(Comparator.comparingDouble(Share::remainder).reversed()
                .thenComparing(Share::id));
        Map<String, Integer> bonus = new TreeMap<>();
        for (int i = 0; i < leftover; i++) {
            bonus.merge(byRemainder.get(i % byRemainder.size()).id(), 1, Integer::sum);
        }

        for (Share share : shares) {
            result.put(share.id(), share.floor() + bonus.getOrDefault(share.id(), 0));
        }
        return result;
    }

    private record Share(String id, int floor, double remainder) {
    }
}
