// file: src/main/java/io/objledger/server/dto/SubmitRequest.java
package io.objledger.server.dto;

/**
 * JSON body for POST /transactions.
 * Example:
 *   {
 *     "txBytesBase64": "AQAB...",
 *     "sender": "0xa11ce"
 *   }
 */
public class SubmitRequest {
    public String txBytesBase64; // canonical transaction bytes, Base64
    public String sender;        // signer; must match the transaction sender
}
