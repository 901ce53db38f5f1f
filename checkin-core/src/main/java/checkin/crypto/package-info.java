/**
 * Decryption of contact phone numbers stored encrypted at rest.
 */
package checkin.crypto;
