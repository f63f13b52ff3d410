package edu.isi.wfst;

public class ShortestPathConfig {
	private float delta = Semiring.KDELTA;
	// discipline for the distance computation behind n-best search
	private QueueType queueType = QueueType.AUTO;

	public float getDelta() { return delta; }
	public QueueType getQueueType() { return queueType; }

	public ShortestPathConfig setDelta(float d) { delta = d; return this; }
	public ShortestPathConfig setQueueType(QueueType q) { queueType = q; return this; }
}
