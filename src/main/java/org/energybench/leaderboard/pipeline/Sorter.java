package org.energybench.leaderboard.pipeline;

import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.MetricDirection;
import org.energybench.leaderboard.model.ProjectedView;
import org.energybench.leaderboard.model.ResultRecord;
import org.energybench.leaderboard.model.SortOrder;
import org.energybench.leaderboard.model.ViewCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Final display ordering of a projected view.
 *
 * <p>The sort is stable and puts missing values last in either direction. If the sort
 * column is not visible the rows keep their insertion order and the view is flagged
 * {@link ViewCondition#SORT_COLUMN_UNAVAILABLE}; no other column is substituted.</p>
 */
public class Sorter {
    private static final Logger logger = LoggerFactory.getLogger(Sorter.class);

    public ProjectedView sort(ProjectedView view, SortOrder order) {
        Objects.requireNonNull(view, "View cannot be null");
        Objects.requireNonNull(order, "Sort order cannot be null");

        if (!view.isVisible(order.getColumn())) {
            logger.info("{} sort column '{}' is not displayed; keeping insertion order",
                view.getTask().getDisplayName(), order.getColumn().getLabel());
            return view.withRecords(view.getRecords(), EnumSet.of(ViewCondition.SORT_COLUMN_UNAVAILABLE));
        }

        List<ResultRecord> sorted = new ArrayList<>(view.getRecords());
        sorted.sort(comparatorFor(order));
        return view.withRecords(sorted, EnumSet.noneOf(ViewCondition.class));
    }

    static Comparator<ResultRecord> comparatorFor(SortOrder order) {
        if (order.getColumn() == Column.RANK) {
            Comparator<Integer> ranks = Comparator.naturalOrder();
            if (order.getDirection() == MetricDirection.HIGHER_IS_BETTER) {
                ranks = ranks.reversed();
            }
            return Comparator.comparing(ResultRecord::getRank, Comparator.nullsLast(ranks));
        }
        return Ranker.bestFirst(order.getColumn(), order.getDirection());
    }
}
