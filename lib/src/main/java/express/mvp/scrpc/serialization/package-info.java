/** Pluggable conversion of call data to bytes; Java serialization by default. */
package express.mvp.scrpc.serialization;
