package edu.isi.wfst;

// state visitation disciplines
public enum QueueType { TRIVIAL, FIFO, LIFO, SHORTEST_FIRST, TOP_ORDER, STATE_ORDER, SCC, AUTO ;
	public static QueueType get(String s) throws ConfigureException {
		for (QueueType q : QueueType.values()) {
			if (q.toString().equalsIgnoreCase(s))
				return q;
		}
		throw new ConfigureException("Invalid queue type ("+s+")");
	}
}
