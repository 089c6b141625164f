/*******************************************************************************
 * BWTSearch - Wildcard substring search over Burrows-Wheeler indexes
 * Copyright 2026 The BWTSearch contributors
 *
 * This file is part of BWTSearch.
 *
 *     BWTSearch is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     BWTSearch is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with BWTSearch.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package bwtsearch.sequences;

import java.util.Deque;

/**
 * Order in which pending search ranges are explored. Results do not depend on this order
 */
public enum SearchTraversal {
	DEPTH_FIRST {
		@Override
		void add(Deque<SearchRange> worklist, SearchRange range) {
			worklist.push(range);
		}
		@Override
		SearchRange next(Deque<SearchRange> worklist) {
			return worklist.pop();
		}
	},
	BREADTH_FIRST {
		@Override
		void add(Deque<SearchRange> worklist, SearchRange range) {
			worklist.offer(range);
		}
		@Override
		SearchRange next(Deque<SearchRange> worklist) {
			return worklist.poll();
		}
	};

	abstract void add(Deque<SearchRange> worklist, SearchRange range);

	abstract SearchRange next(Deque<SearchRange> worklist);
}
