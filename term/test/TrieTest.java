/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.requirement.term.test;

import com.google.common.collect.ImmutableList;
import com.vaticle.requirement.term.RewriteContext;
import com.vaticle.requirement.term.Symbol;
import com.vaticle.requirement.term.Trie;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class TrieTest {

    private Symbol a;
    private Symbol b;
    private Symbol c;

    @Before
    public void setUp() {
        RewriteContext context = new RewriteContext();
        a = context.name("a");
        b = context.name("b");
        c = context.name("c");
    }

    @Test
    public void find_returns_the_shortest_accepted_prefix() {
        Trie<Integer> trie = new Trie<>();
        trie.insert(ImmutableList.of(a), 0);
        trie.insert(ImmutableList.of(a, b), 1);

        assertEquals(Optional.of(0), trie.find(ImmutableList.of(a, b, c), 0, id -> true));
        assertEquals(Optional.of(1), trie.find(ImmutableList.of(a, b, c), 0, id -> id != 0));
        assertEquals(Optional.empty(), trie.find(ImmutableList.of(a, b, c), 1, id -> true));
        assertEquals(Optional.of(0), trie.find(ImmutableList.of(c, a), 1, id -> true));
    }

    @Test
    public void insert_supersedes_an_existing_value() {
        Trie<Integer> trie = new Trie<>();
        assertFalse(trie.insert(ImmutableList.of(a, b), 0).isPresent());
        assertEquals(Optional.of(0), trie.insert(ImmutableList.of(a, b), 1));
        assertEquals(Optional.of(1), trie.get(ImmutableList.of(a, b)));
        assertEquals(Optional.empty(), trie.get(ImmutableList.of(a)));
    }

    @Test
    public void find_all_visits_prefixes_and_extensions() {
        Trie<Integer> trie = new Trie<>();
        trie.insert(ImmutableList.of(b), 0);
        trie.insert(ImmutableList.of(b, c), 1);
        trie.insert(ImmutableList.of(b, c, a), 2);
        trie.insert(ImmutableList.of(c), 3);

        List<Integer> visited = new ArrayList<>();
        trie.findAll(ImmutableList.of(a, b), 1, visited::add);
        Set<Integer> expected = new HashSet<>(ImmutableList.of(0, 1, 2));
        assertEquals(expected, new HashSet<>(visited));
        assertEquals(3, visited.size());

        visited.clear();
        trie.findAll(ImmutableList.of(b, c, a, b), 0, visited::add);
        assertEquals(ImmutableList.of(0, 1, 2), visited);
    }
}
