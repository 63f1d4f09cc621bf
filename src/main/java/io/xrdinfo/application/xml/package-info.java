/**
 * Hardened DOM parsing shared by shared-parameters, anchor, SOAP and WSDL readers.
 */
package io.xrdinfo.application.xml;
