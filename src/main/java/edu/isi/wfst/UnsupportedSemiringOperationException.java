package edu.isi.wfst;
/** division or closure requested from a semiring that cannot provide it,
    or a division by a non-invertible weight */
public class UnsupportedSemiringOperationException extends FstException {
    /**          Constructs a new exception with null as its detail message. */
    public UnsupportedSemiringOperationException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public UnsupportedSemiringOperationException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public UnsupportedSemiringOperationException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public UnsupportedSemiringOperationException(Throwable cause) { super(cause); } 
}
