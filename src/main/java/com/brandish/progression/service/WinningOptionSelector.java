package com.brandish.progression.service;

import com.brandish.progression.model.VotingOption;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Ballot resolution and option sampling.
 * <p>
 * Winner: a ballot with no votes picks uniformly at random; otherwise the highest count wins,
 * then the earliest {@code lastHighestVoteAt} (stamped beats unstamped), then the lowest id.
 */
public final class WinningOptionSelector {

    private static final Comparator<VotingOption> RANKING = Comparator
            .comparing((VotingOption option) -> option.getVoteCount() == null ? 0 : option.getVoteCount(),
                    Comparator.reverseOrder())
            .thenComparing(VotingOption::getLastHighestVoteAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(VotingOption::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private WinningOptionSelector() {
    }

    public static Optional<VotingOption> select(List<VotingOption> options, Random random) {
        if (options == null || options.isEmpty()) {
            return Optional.empty();
        }
        boolean noVotes = options.stream().allMatch(option -> option.getVoteCount() == null || option.getVoteCount() == 0);
        if (noVotes) {
            return Optional.of(options.get(random.nextInt(options.size())));
        }
        return options.stream().min(RANKING);
    }

    /**
     * Up to {@code count} distinct elements drawn with a Fisher-Yates shuffle.
     */
    public static <T> List<T> sample(List<T> candidates, int count, Random random) {
        if (candidates.size() <= count) {
            return new ArrayList<>(candidates);
        }
        List<T> shuffled = new ArrayList<>(candidates);
        for (int i = shuffled.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T swap = shuffled.get(i);
            shuffled.set(i, shuffled.get(j));
            shuffled.set(j, swap);
        }
        return new ArrayList<>(shuffled.subList(0, count));
    }
}
