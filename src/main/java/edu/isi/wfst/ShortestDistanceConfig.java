package edu.isi.wfst;

// knobs of the generic single-source shortest distance
public class ShortestDistanceConfig {
	private QueueType queueType = QueueType.AUTO;
	private float delta = Semiring.KDELTA;
	private int source = Transition.NO_STATE;

	public QueueType getQueueType() { return queueType; }
	public float getDelta() { return delta; }
	/** NO_STATE means the start state */
	public int getSource() { return source; }

	public ShortestDistanceConfig setQueueType(QueueType q) { queueType = q; return this; }
	public ShortestDistanceConfig setDelta(float d) { delta = d; return this; }
	public ShortestDistanceConfig setSource(int s) { source = s; return this; }
}
