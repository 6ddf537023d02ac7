package com.mesosphere.allocator.sorter;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Orders siblings by a weighted random shuffle: at each position, a remaining sibling is picked with probability
 * proportional to its weight. Allocations are tracked but do not influence the order.
 *
 * <p>The generator is seeded, so the same sequence of calls on two instances with the same seed yields the same
 * orders.
 */
public class RandomSorter extends AbstractTreeSorter {

    private final Random random;

    public RandomSorter(String name, boolean hierarchical, long seed) {
        super(name, hierarchical);
        this.random = new Random(seed);
    }

    @Override
    protected void orderSiblings(List<Candidate> siblings) {
        // Start from registration order so that the shuffle only depends on the seed and call sequence.
        siblings.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
        List<Candidate> remaining = new ArrayList<>(siblings);
        siblings.clear();
        while (!remaining.isEmpty()) {
            double totalWeight = 0;
            for (Candidate candidate : remaining) {
                totalWeight += candidate.getWeight();
            }
            double pick = random.nextDouble() * totalWeight;
            int index = 0;
            for (; index < remaining.size() - 1; ++index) {
                pick -= remaining.get(index).getWeight();
                if (pick < 0) {
                    break;
                }
            }
            siblings.add(remaining.remove(index));
        }
    }
}
