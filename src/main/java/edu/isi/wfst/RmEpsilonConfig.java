package edu.isi.wfst;

public class RmEpsilonConfig {
	private float delta = Semiring.KDELTA;
	private boolean connect = true;
	// FIFO or LIFO; AUTO means FIFO
	private QueueType queueType = QueueType.AUTO;

	public float getDelta() { return delta; }
	public boolean isConnect() { return connect; }
	public QueueType getQueueType() { return queueType; }

	public RmEpsilonConfig setDelta(float d) { delta = d; return this; }
	public RmEpsilonConfig setConnect(boolean b) { connect = b; return this; }
	public RmEpsilonConfig setQueueType(QueueType q) { queueType = q; return this; }
}
