package edu.isi.wfst;

import java.util.Arrays;

/**
 * Immutable call stack of a replacement: (automaton index, return state) frames,
 * innermost last.
 */
public final class ReplaceStack {
	public static final ReplaceStack EMPTY = new ReplaceStack(new int[0]);

	private final int[] frames;

	private ReplaceStack(int[] frames) {
		this.frames = frames;
	}
	public int depth() { return frames.length/2; }
	public boolean isEmpty() { return frames.length == 0; }
	public int topFst() { return frames[frames.length-2]; }
	public int topReturnState() { return frames[frames.length-1]; }

	public ReplaceStack push(int fst, int returnState) {
		int[] f = Arrays.copyOf(frames, frames.length+2);
		f[frames.length] = fst;
		f[frames.length+1] = returnState;
		return new ReplaceStack(f);
	}
	public ReplaceStack pop() {
		return new ReplaceStack(Arrays.copyOf(frames, frames.length-2));
	}
	public boolean equals(Object o) {
		return o instanceof ReplaceStack && Arrays.equals(frames, ((ReplaceStack)o).frames);
	}
	public int hashCode() { return Arrays.hashCode(frames); }
	public String toString() { return Arrays.toString(frames); }
}
