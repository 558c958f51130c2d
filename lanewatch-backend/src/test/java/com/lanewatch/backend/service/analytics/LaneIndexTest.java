package com.lanewatch.backend.service.analytics;

import com.lanewatch.backend.model.lane.Lane;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LaneIndexTest {

    private final LaneIndex index = new LaneIndex(List.of(
            new Lane(2, 100, 0, 200, 100),
            new Lane(1, 0, 0, 100, 100)));

    @Test
    void locatesPointsWithInclusiveBounds() {
        assertThat(index.locate(50, 50)).map(Lane::getIndex).contains(1);
        assertThat(index.locate(150, 100)).map(Lane::getIndex).contains(2);
        assertThat(index.locate(0, 0)).map(Lane::getIndex).contains(1);
        assertThat(index.locate(250, 50)).isEmpty();
    }

    @Test
    void sharedEdgeGoesToLowestIndex() {
        assertThat(index.locate(100, 50)).map(Lane::getIndex).contains(1);
    }

    @Test
    void refusesEmptyOrGappedLayouts() {
        assertThatThrownBy(() -> new LaneIndex(List.of()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new LaneIndex(List.of(new Lane(1, 0, 0, 1, 1), new Lane(3, 2, 2, 3, 3))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("without gaps");
    }

    @Test
    void laneRejectsInvertedBounds() {
        assertThatThrownBy(() -> new Lane(1, 10, 0, 5, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assignmentStaysWithLastLaneOutsideAllRectangles() {
        LaneAssignments assignments = new LaneAssignments(index);

        assertThat(assignments.resolve(7, 50, 50)).isEqualTo(1);
        assertThat(assignments.resolve(7, 50, 500)).isEqualTo(1);
        assertThat(assignments.resolve(7, 150, 50)).isEqualTo(2);
        assertThat(assignments.resolve(8, 500, 500)).isNull();
    }

    @Test
    void evictsInactiveVehicles() {
        LaneAssignments assignments = new LaneAssignments(index);
        assignments.resolve(1, 50, 50);
        assignments.resolve(2, 150, 50);

        assignments.retainActive(Set.of(2));

        assertThat(assignments.size()).isEqualTo(1);
        assertThat(assignments.resolve(1, 500, 500)).isNull();
        assertThat(assignments.resolve(2, 500, 500)).isEqualTo(2);
    }
}
