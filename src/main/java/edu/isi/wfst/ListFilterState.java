package edu.isi.wfst;

import java.util.Arrays;

// ordered list of integers; order matters for equality. null list is the blocked state
public final class ListFilterState implements FilterState {
	public static final ListFilterState BLOCKED = new ListFilterState(null);

	private final int[] list;

	public ListFilterState(int[] list) {
		this.list = list == null ? null : list.clone();
	}
	public int[] getList() {
		return list == null ? null : list.clone();
	}
	public boolean isBlocked() { return list == null; }
	public boolean equals(Object o) {
		if (!(o instanceof ListFilterState))
			return false;
		return Arrays.equals(list, ((ListFilterState)o).list);
	}
	public int hashCode() {
		return Arrays.hashCode(list);
	}
	public String toString() {
		return list == null ? "blocked" : Arrays.toString(list);
	}
}
