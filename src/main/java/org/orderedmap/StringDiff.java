package org.orderedmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * Character-level difference between two strings, computed with Myers' O(ND) shortest edit script algorithm (E. W. Myers, "An O(ND)
 * Difference Algorithm and Its Variations", Algorithmica 1, 1986).
 * </p>
 *
 * <p>
 * This is meant for failure reports, e.g. comparing the printed expected and actual state of a structure in a test. Memory use is
 * proportional to the product of the edit distance and the combined length of the strings. Past {@link #MAX_TRACE_SIZE}, the script is
 * no longer minimal: the common prefix and suffix are kept and everything between them is reported as one deletion and one insertion.
 * </p>
 */
public class StringDiff {
	/** ANSI escape starting red text, used for deleted characters */
	public static final String DELETE_COLOR = "\u001B[31m";
	/** ANSI escape starting green text, used for inserted characters */
	public static final String INSERT_COLOR = "\u001B[32m";
	/** ANSI escape resetting the text color */
	public static final String RESET_COLOR = "\u001B[0m";
	/** The largest number of trace cells the search for a shortest edit script may record */
	public static final long MAX_TRACE_SIZE = 1L << 22;

	/** The kinds of edit in an edit script */
	public enum Operation {
		/** Text common to both strings */
		EQUAL,
		/** Text present only in the second string */
		INSERT,
		/** Text present only in the first string */
		DELETE;
	}

	/** A run of characters that was kept, inserted or deleted */
	public static class Edit {
		private final Operation theOperation;
		private final String theText;

		/**
		 * @param operation The operation for the edit
		 * @param text The text that the operation applies to
		 */
		public Edit(Operation operation, String text) {
			theOperation = operation;
			theText = text;
		}

		/** @return The operation for this edit */
		public Operation getOperation() {
			return theOperation;
		}

		/** @return The text that this edit's operation applies to */
		public String getText() {
			return theText;
		}

		@Override
		public int hashCode() {
			return theOperation.hashCode() * 31 + theText.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Edit && theOperation == ((Edit) obj).theOperation && theText.equals(((Edit) obj).theText);
		}

		@Override
		public String toString() {
			return theOperation + "(" + theText + ")";
		}
	}

	private StringDiff() {}

	/**
	 * @param first The first string
	 * @param second The second string
	 * @return The second string, with text deleted from the first string inserted in {@link #DELETE_COLOR red} and text inserted into the
	 *         second string highlighted in {@link #INSERT_COLOR green}; or null if the two strings are equal
	 */
	public static String diff(CharSequence first, CharSequence second) {
		return render(first, second, DELETE_COLOR, RESET_COLOR, INSERT_COLOR, RESET_COLOR);
	}

	/**
	 * Like {@link #diff(CharSequence, CharSequence)}, but marks deleted text as <code>[-deleted-]</code> and inserted text as
	 * <code>{+inserted+}</code> instead of using color
	 *
	 * @param first The first string
	 * @param second The second string
	 * @return The marked-up difference, or null if the two strings are equal
	 */
	public static String plain(CharSequence first, CharSequence second) {
		return render(first, second, "[-", "-]", "{+", "+}");
	}

	private static String render(CharSequence first, CharSequence second, String delStart, String delEnd, String insStart,
		String insEnd) {
		List<Edit> script = editScript(first, second);
		if (script.size() <= 1 && (script.isEmpty() || script.get(0).getOperation() == Operation.EQUAL))
			return null;
		StringBuilder str = new StringBuilder();
		for (Edit edit : script) {
			switch (edit.getOperation()) {
			case EQUAL:
				str.append(edit.getText());
				break;
			case DELETE:
				str.append(delStart).append(edit.getText()).append(delEnd);
				break;
			case INSERT:
				str.append(insStart).append(edit.getText()).append(insEnd);
				break;
			}
		}
		return str.toString();
	}

	/**
	 * Computes a shortest edit script transforming one string into another, or a coarser one if the strings are too large and different
	 * (see {@link #MAX_TRACE_SIZE}). Adjacent edits of the same kind are merged.
	 *
	 * @param first The first string
	 * @param second The second string
	 * @return The edits that transform the first string into the second
	 */
	public static List<Edit> editScript(CharSequence first, CharSequence second) {
		int n = first.length();
		int m = second.length();
		List<int[]> trace = shortestEditTrace(first, second);
		if (trace == null)
			return coarseEditScript(first, second);

		// Walk back from the end through the trace, recording single-character edits in reverse
		List<Operation> ops = new ArrayList<>(n + m);
		List<Character> chars = new ArrayList<>(n + m);
		int offset = n + m + 1;
		int x = n, y = m;
		for (int d = trace.size() - 1; d >= 0; d--) {
			int[] v = trace.get(d);
			int k = x - y;
			int prevK;
			if (k == -d || (k != d && v[offset + k - 1] < v[offset + k + 1]))
				prevK = k + 1;
			else
				prevK = k - 1;
			int prevX = v[offset + prevK];
			int prevY = prevX - prevK;
			while (x > prevX && y > prevY) {
				ops.add(Operation.EQUAL);
				chars.add(first.charAt(x - 1));
				x--;
				y--;
			}
			if (d > 0) {
				if (x == prevX) {
					ops.add(Operation.INSERT);
					chars.add(second.charAt(prevY));
				} else {
					ops.add(Operation.DELETE);
					chars.add(first.charAt(prevX));
				}
			}
			x = prevX;
			y = prevY;
		}
		Collections.reverse(ops);
		Collections.reverse(chars);

		List<Edit> edits = new ArrayList<>();
		StringBuilder run = new StringBuilder();
		Operation runOp = null;
		for (int i = 0; i < ops.size(); i++) {
			if (ops.get(i) != runOp && run.length() > 0) {
				edits.add(new Edit(runOp, run.toString()));
				run.setLength(0);
			}
			runOp = ops.get(i);
			run.append(chars.get(i).charValue());
		}
		if (run.length() > 0)
			edits.add(new Edit(runOp, run.toString()));
		return edits;
	}

	private static List<Edit> coarseEditScript(CharSequence first, CharSequence second) {
		int n = first.length();
		int m = second.length();
		int prefix = 0;
		while (prefix < n && prefix < m && first.charAt(prefix) == second.charAt(prefix))
			prefix++;
		int suffix = 0;
		while (suffix < n - prefix && suffix < m - prefix && first.charAt(n - suffix - 1) == second.charAt(m - suffix - 1))
			suffix++;
		List<Edit> edits = new ArrayList<>(4);
		if (prefix > 0)
			edits.add(new Edit(Operation.EQUAL, first.subSequence(0, prefix).toString()));
		if (prefix + suffix < n)
			edits.add(new Edit(Operation.DELETE, first.subSequence(prefix, n - suffix).toString()));
		if (prefix + suffix < m)
			edits.add(new Edit(Operation.INSERT, second.subSequence(prefix, m - suffix).toString()));
		if (suffix > 0)
			edits.add(new Edit(Operation.EQUAL, first.subSequence(n - suffix, n).toString()));
		return edits;
	}

	/**
	 * The forward pass of the algorithm. Each array in the returned list holds the furthest-reaching x for each diagonal k (indexed from
	 * <code>n+m+1</code>) before the search for edit distance d began, where d is the array's index in the list. Null if the trace would
	 * exceed {@link #MAX_TRACE_SIZE}.
	 */
	private static List<int[]> shortestEditTrace(CharSequence first, CharSequence second) {
		int n = first.length();
		int m = second.length();
		int max = n + m;
		int offset = max + 1;
		int[] v = new int[2 * max + 3];
		List<int[]> trace = new ArrayList<>();
		for (int d = 0; d <= max; d++) {
			if ((long) (d + 1) * v.length > MAX_TRACE_SIZE)
				return null;
			trace.add(v.clone());
			for (int k = -d; k <= d; k += 2) {
				int x;
				if (k == -d || (k != d && v[offset + k - 1] < v[offset + k + 1]))
					x = v[offset + k + 1];
				else
					x = v[offset + k - 1] + 1;
				int y = x - k;
				while (x < n && y < m && first.charAt(x) == second.charAt(y)) {
					x++;
					y++;
				}
				v[offset + k] = x;
				if (x >= n && y >= m)
					return trace;
			}
		}
		return trace;
	}
}
