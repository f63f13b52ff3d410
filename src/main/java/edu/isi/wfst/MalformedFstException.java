package edu.isi.wfst;
/** inconsistent automaton: references to states that do not exist,
    bad start state, and the like */
public class MalformedFstException extends FstException {
    /**          Constructs a new exception with null as its detail message. */
    public MalformedFstException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public MalformedFstException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public MalformedFstException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public MalformedFstException(Throwable cause) { super(cause); } 
}
