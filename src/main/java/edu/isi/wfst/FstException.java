package edu.isi.wfst;
/** root of the recoverable errors thrown by automaton operations.
    Algorithms fail fast and hand these back to the caller; nothing is logged. */
public class FstException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public FstException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public FstException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public FstException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public FstException(Throwable cause) { super(cause); } 
}
