package edu.isi.wfst;
/** unchecked: raised inside the weight algebra when two weights cannot be
    combined at all, e.g. restricted string plus on two different strings */
public class IncompatibleWeightsException extends RuntimeException {
    /**          Constructs a new exception with null as its detail message. */
    public IncompatibleWeightsException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public IncompatibleWeightsException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public IncompatibleWeightsException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public IncompatibleWeightsException(Throwable cause) { super(cause); } 
}
