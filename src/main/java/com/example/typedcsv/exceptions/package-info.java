/**
 * Exceptions raised by header matching and row marshalling.
 */
package com.example.typedcsv.exceptions;
