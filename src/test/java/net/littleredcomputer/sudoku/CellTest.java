// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.junit.Test;

import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;

public class CellTest {
    @Test
    public void everyCellHasTwentyPeers() {
        for (Cell c : Cell.ALL) {
            assertThat(c.peers(), hasSize(20));
            assertThat(c.peers(), not(hasItem(c)));
            assertThat(c.peers().stream().distinct().count(), is(20L));
        }
    }

    @Test
    public void peersAreSymmetric() {
        for (Cell c : Cell.ALL) {
            for (Cell p : c.peers()) assertThat(p.peers(), hasItem(c));
        }
    }

    @Test
    public void peersOfCenter() {
        assertThat(Cell.of(4, 4).peers().stream().map(Cell::toString).collect(Collectors.joining(" ")),
                is("(0,4) (1,4) (2,4) (3,3) (3,4) (3,5) " +
                        "(4,0) (4,1) (4,2) (4,3) (4,5) (4,6) (4,7) (4,8) " +
                        "(5,3) (5,4) (5,5) (6,4) (7,4) (8,4)"));
    }

    @Test
    public void coordinates() {
        Cell c = Cell.of(7, 2);
        assertThat(c.index(), is(65));
        assertThat(c.box(), is(6));
        assertThat(Cell.ofIndex(65), is(sameInstance(c)));
        assertThat(Cell.of(0, 8).box(), is(2));
        assertThat(Cell.of(5, 5).box(), is(4));
        assertThat(Cell.ALL.get(80), is(sameInstance(Cell.of(8, 8))));
    }

    @Test
    public void rowMajorOrder() {
        assertThat(Cell.of(0, 8).compareTo(Cell.of(1, 0)) < 0, is(true));
        assertThat(Cell.of(3, 1).compareTo(Cell.of(3, 0)) > 0, is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rowOutOfRange() {
        Cell.of(9, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeColumn() {
        Cell.of(0, -1);
    }
}
